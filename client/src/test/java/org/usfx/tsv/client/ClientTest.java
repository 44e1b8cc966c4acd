package org.usfx.tsv.client;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.endsWith;
import static org.hamcrest.Matchers.is;

import io.vertx.core.Vertx;
import io.vertx.ext.unit.TestContext;
import io.vertx.ext.unit.junit.VertxUnitRunner;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.usfx.tsv.util.TagKind;
import org.usfx.tsv.util.UsfxException;

@RunWith(VertxUnitRunner.class)
public class ClientTest {

  Vertx vertx;
  ByteArrayOutputStream out;
  Client client;

  @Before
  public void before() {
    vertx = Vertx.vertx();
    out = new ByteArrayOutputStream();
    client = new Client(vertx, out);
  }

  @After
  public void after(TestContext context) {
    vertx.close().onComplete(context.asyncAssertSuccess());
  }

  String output() {
    return out.toString(StandardCharsets.UTF_8);
  }

  @Test
  public void help(TestContext context) {
    String [] args = { "--help" };
    Client.exec(client, args).onComplete(context.asyncAssertSuccess(x ->
        assertThat(output(), is(""))));
  }

  @Test
  public void mainHelp() {
    Main.main(new String[] { "--help" });
  }

  @Test
  public void badArgs(TestContext context) {
    String [] args = { "--bad", "value" };
    Client.exec(client, args).onComplete(context.asyncAssertFailure(x ->
        context.assertEquals("Unsupported option: '--bad'", x.getMessage())));
  }

  @Test
  public void missingArgs(TestContext context) {
    String [] args = { "--tags" };
    Client.exec(client, args).onComplete(context.asyncAssertFailure(x ->
        context.assertEquals("Missing argument for option '--tags'", x.getMessage())));
  }

  @Test
  public void extraArgs(TestContext context) {
    String [] args = { "gen.xml", "exo.xml" };
    Client.exec(client, args).onComplete(context.asyncAssertFailure(x ->
        context.assertEquals("Unexpected argument: 'exo.xml'", x.getMessage())));
  }

  @Test
  public void fileNotFound(TestContext context) {
    String [] args = { "unknownfile.xml" };
    Client.exec(client, args).onComplete(context.asyncAssertFailure(x ->
        assertThat(x.getMessage(), containsString("unknownfile.xml"))));
  }

  @Test
  public void defaultInput(TestContext context) {
    String [] args = { };
    Client.exec(client, args).onComplete(context.asyncAssertFailure(x ->
        assertThat(x.getMessage(), containsString("source.xml"))));
  }

  @Test
  public void convert(TestContext context) {
    String [] args = { "gen.xml" };
    Client.exec(client, args).onComplete(context.asyncAssertSuccess(x -> {
      String tsv = output();
      String[] lines = tsv.split("\n", -1);
      assertThat(lines.length, is(7));
      assertThat(lines[0],
          is("GEN\t1\t1\tIn the beginning, God created the heavens and the earth."));
      assertThat(lines[4],
          is("GEN\t2\t6-7\tA mist went up and watered the whole surface of the ground."));
      assertThat(lines[5], is("EXO\t1\t1\tNow these are the names of the sons of Israel."));
      assertThat(tsv, endsWith(".\n"));
      assertThat(client.getVerseCount(), is(6L));
    }));
  }

  @Test
  public void convertTwice(TestContext context) {
    client.convertFile("gen.xml")
        .compose(count -> {
          String first = output();
          out.reset();
          return client.convertFile("gen.xml").map(first);
        })
        .onComplete(context.asyncAssertSuccess(first -> {
          assertThat(output(), is(first));
          assertThat(client.getVerseCount(), is(12L));
        }));
  }

  @Test
  public void tags(TestContext context) {
    String [] args = { "--tags", "tags.json", "gen.xml" };
    Client.exec(client, args).onComplete(context.asyncAssertSuccess(x -> {
      assertThat(client.getTags().kindOf("w"), is(TagKind.ANNOTATION));
      assertThat(output(), containsString("GEN\t1\t1\t, God created"));
    }));
  }

  @Test
  public void tagsAfterFile(TestContext context) {
    String [] args = { "gen.xml", "--tags", "tags.json" };
    Client.exec(client, args).onComplete(context.asyncAssertSuccess(x -> {
      assertThat(client.getTags().kindOf("w"), is(TagKind.ANNOTATION));
      assertThat(output(), containsString("GEN\t1\t1\t, God created"));
    }));
  }

  @Test
  public void extraArgsAfterOption(TestContext context) {
    String [] args = { "gen.xml", "--tags", "tags.json", "exo.xml" };
    Client.exec(client, args).onComplete(context.asyncAssertFailure(x -> {
      context.assertEquals("Unexpected argument: 'exo.xml'", x.getMessage());
      assertThat(output(), is(""));
    }));
  }

  @Test
  public void badTags(TestContext context) {
    String [] args = { "--tags", "badtags.json", "gen.xml" };
    Client.exec(client, args).onComplete(context.asyncAssertFailure(x -> {
      assertThat(x.getMessage(), is("Unknown tag kind: 'italic'"));
      assertThat(output(), is(""));
    }));
  }

  @Test
  public void missingContext(TestContext context) {
    String [] args = { "nobook.xml" };
    Client.exec(client, args).onComplete(context.asyncAssertFailure(x -> {
      assertThat(((UsfxException) x).getErrorKind(),
          is(UsfxException.ErrorKind.MISSING_CONTEXT));
      assertThat(output(), is(""));
    }));
  }
}
