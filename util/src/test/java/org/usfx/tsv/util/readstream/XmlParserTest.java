package org.usfx.tsv.util.readstream;

import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.file.OpenOptions;
import io.vertx.ext.unit.TestContext;
import io.vertx.ext.unit.junit.VertxUnitRunner;
import java.util.ArrayList;
import java.util.List;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamReader;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.usfx.tsv.util.UsfxException;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;

@RunWith(VertxUnitRunner.class)
public class XmlParserTest {
  Vertx vertx;

  @Before
  public void before() {
    vertx = Vertx.vertx();
  }

  @After
  public void after(TestContext context) {
    vertx.close().onComplete(context.asyncAssertSuccess());
  }

  Future<XmlParser> xmlParserFromFile(String fname) {
    return vertx.fileSystem().open(fname, new OpenOptions().setCreate(false).setWrite(false))
        .map(asyncFile -> {
          XmlParser xmlParser = XmlParser.newParser(asyncFile);
          xmlParser.pause();
          return xmlParser;
        });
  }

  Future<List<Integer>> eventsFromFile(String fname) {
    List<Integer> events = new ArrayList<>();
    return xmlParserFromFile(fname).compose(xmlParser -> {
      Promise<List<Integer>> promise = Promise.promise();
      xmlParser.handler(event -> events.add(event.getEventType()));
      xmlParser.endHandler(e -> promise.complete(events));
      xmlParser.exceptionHandler(promise::tryFail);
      xmlParser.resume();
      return promise.future();
    });
  }

  @Test
  public void small(TestContext context) {
    eventsFromFile("small.xml").onComplete(context.asyncAssertSuccess(events -> {
      assertThat(events, contains(XMLStreamConstants.START_DOCUMENT,
          XMLStreamConstants.START_ELEMENT, XMLStreamConstants.END_ELEMENT,
          XMLStreamConstants.END_DOCUMENT));
    }));
  }

  @Test
  public void bad(TestContext context) {
    eventsFromFile("bad.xml").onComplete(context.asyncAssertFailure(e -> {
      assertThat(e.getClass().getName(), is(UsfxException.class.getName()));
      assertThat(((UsfxException) e).getErrorKind(), is(UsfxException.ErrorKind.MALFORMED_XML));
    }));
  }

  @Test
  public void incompleteInput() {
    XmlMapper xmlMapper = new XmlMapper();
    xmlMapper.push(Buffer.buffer("<usfx><book id=\"GEN\">"));
    List<Integer> events = new ArrayList<>();
    while (true) {
      Integer event = pollEvent(xmlMapper);
      if (event == null) {
        break;
      }
      events.add(event);
    }
    assertThat(events, not(empty()));
    xmlMapper.end();
    UsfxException e = Assert.assertThrows(UsfxException.class, xmlMapper::poll);
    assertThat(e.getErrorKind(), is(UsfxException.ErrorKind.MALFORMED_XML));
  }

  @Test
  public void feedAfterEnd() {
    XmlMapper xmlMapper = new XmlMapper();
    xmlMapper.push(Buffer.buffer("<"));
    xmlMapper.end();
    Buffer xml2 = Buffer.buffer("usfx/>");
    // we are violating the contract by using push after end
    UsfxException e = Assert.assertThrows(UsfxException.class, () -> xmlMapper.push(xml2));
    assertThat(e.getErrorKind(), is(UsfxException.ErrorKind.MALFORMED_XML));
  }

  @Test
  public void nothingBeforeInput() {
    XmlMapper xmlMapper = new XmlMapper();
    assertThat(xmlMapper.poll(), nullValue());
  }

  static Integer pollEvent(XmlMapper xmlMapper) {
    XMLStreamReader reader = xmlMapper.poll();
    return reader == null ? null : reader.getEventType();
  }
}
