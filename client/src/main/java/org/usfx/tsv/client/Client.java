package org.usfx.tsv.client;

import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.file.OpenOptions;
import io.vertx.core.json.JsonObject;
import java.io.BufferedOutputStream;
import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.usfx.tsv.util.UsfxTags;
import org.usfx.tsv.util.readstream.VerseParser;

@java.lang.SuppressWarnings({"squid:S106"})
public class Client {
  static final Logger log = LogManager.getLogger(Client.class);

  static final String DEFAULT_INPUT = "xml/source.xml";

  final Vertx vertx;
  final PrintStream out;
  UsfxTags tags = UsfxTags.defaults();
  long verseCount;

  /**
   * Construct client.
   * @param vertx Vert.x handle
   * @param out where TSV lines are written
   */
  public Client(Vertx vertx, OutputStream out) {
    this.vertx = vertx;
    this.out = new PrintStream(out, false, StandardCharsets.UTF_8);
  }

  public Client(Vertx vertx) {
    this(vertx, new BufferedOutputStream(new FileOutputStream(FileDescriptor.out)));
  }

  public UsfxTags getTags() {
    return tags;
  }

  public long getVerseCount() {
    return verseCount;
  }

  /**
   * Merge tag table overrides from JSON file.
   * @param fname filename of tag table
   * @return async result
   */
  public Future<Void> setTags(String fname) {
    return vertx.fileSystem().readFile(fname)
        .map(buffer -> {
          tags = tags.merge(new JsonObject(buffer));
          log.debug("Tag table from {}: {}", fname, tags.toJson().encode());
          return null;
        });
  }

  /**
   * Convert USFX file and write TSV lines to output.
   * @param fname filename of USFX document
   * @return async result with number of verses written
   */
  public Future<Long> convertFile(String fname) {
    return vertx.fileSystem().open(fname, new OpenOptions().setCreate(false).setWrite(false))
        .compose(asyncFile -> {
          Promise<Long> promise = Promise.promise();
          long[] count = {0L};
          VerseParser parser = VerseParser.newParser(asyncFile, tags);
          parser.handler(verseRecord -> {
            out.print(verseRecord.toTsv());
            out.print('\n');
            count[0]++;
          });
          parser.exceptionHandler(e -> {
            out.flush();
            promise.tryFail(e);
          });
          parser.endHandler(end -> {
            out.flush();
            promise.tryComplete(count[0]);
          });
          return promise.future()
              .onComplete(x -> asyncFile.close());
        })
        .onSuccess(count -> {
          verseCount += count;
          log.info("Converted {} verses from {}", count, fname);
        });
  }

  private static String getArgument(String [] args, int i) {
    if (i >= args.length) {
      throw new ClientException("Missing argument for option '" + args[i - 1] + "'");
    }
    return args[i];
  }

  /** Execute command line USFX to TSV conversion.
   *
   * @param vertx Vert.x handle
   * @param args command line args
   * @return async result
   */
  public static Future<Void> exec(Vertx vertx, String[] args) {
    return exec(new Client(vertx), args);
  }

  static Future<Void> exec(Client client, String[] args) {
    try {
      Future<Void> future = Future.succeededFuture();
      String input = null;
      int i = 0;
      while (i < args.length) {
        String arg;
        if (args[i].startsWith("--")) {
          switch (args[i].substring(2)) {
            case "help":
              System.out.println("[options] [file] [options]");
              System.out.println(" --tags file         (JSON tag table merged over defaults)");
              System.out.println(" file                (USFX input; defaults to "
                  + DEFAULT_INPUT + ")");
              return future;
            case "tags":
              arg = getArgument(args, ++i);
              future = future.compose(x -> client.setTags(arg));
              break;
            default:
              throw new ClientException("Unsupported option: '" + args[i] + "'");
          }
        } else if (input == null) {
          input = args[i];
        } else {
          throw new ClientException("Unexpected argument: '" + args[i] + "'");
        }
        i++;
      }
      String fname = input == null ? DEFAULT_INPUT : input;
      return future.compose(x -> client.convertFile(fname)).mapEmpty();
    } catch (Exception e) {
      return Future.failedFuture(e);
    }
  }
}
