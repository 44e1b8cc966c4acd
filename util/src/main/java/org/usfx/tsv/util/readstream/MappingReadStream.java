package org.usfx.tsv.util.readstream;

import io.vertx.core.Handler;
import io.vertx.core.streams.ReadStream;

public class MappingReadStream<T,V> implements ReadStream<T>, Handler<V> {

  boolean emitting;

  long demand = Long.MAX_VALUE;

  boolean ended;

  boolean failed;

  boolean pushed;

  protected final ReadStream<V> stream;

  Handler<T> eventHandler;

  Handler<Void> endHandler;

  Handler<Throwable> exceptionHandler;

  final Mapper<V, T> mapper;

  /**
   * Wrap a read stream with a stream capable of applying mapper to the stream's elements.
   * @param stream stream to wrap
   * @param mapper mapper to apply
   */
  public MappingReadStream(ReadStream<V> stream, Mapper<V, T> mapper) {
    this.stream = stream;
    this.mapper = mapper;
    stream.handler(this);
    stream.endHandler(v -> end());
    stream.exceptionHandler(this::fail);
  }

  @Override
  public ReadStream<T> exceptionHandler(Handler<Throwable> handler) {
    exceptionHandler = handler;
    return this;
  }

  @Override
  public ReadStream<T> handler(Handler<T> handler) {
    eventHandler = handler;
    return this;
  }

  @Override
  public ReadStream<T> pause() {
    demand = 0L;
    return this;
  }

  @Override
  public ReadStream<T> resume() {
    return fetch(Long.MAX_VALUE);
  }

  @Override
  public ReadStream<T> fetch(long l) {
    demand += l;
    if (demand < 0L) {
      demand = Long.MAX_VALUE;
    }
    checkPending();
    return this;
  }

  @Override
  public ReadStream<T> endHandler(Handler<Void> handler) {
    if (!ended) {
      endHandler = handler;
    }
    return this;
  }

  void end() {
    if (ended) {
      throw new IllegalStateException("Parsing already done");
    }
    ended = true;
    pushed = true;
    if (failed) {
      return;
    }
    try {
      mapper.end();
    } catch (Exception e) {
      fail(e);
      return;
    }
    checkPending();
  }

  @Override
  public void handle(V event) {
    if (failed) {
      return;
    }
    try {
      mapper.push(event);
      pushed = true;
    } catch (Exception e) {
      fail(e);
      return;
    }
    checkPending();
  }

  private void fail(Throwable e) {
    if (failed) {
      return; // only interested in first error
    }
    failed = true;
    endHandler = null;
    stream.handler(null);
    if (exceptionHandler != null) {
      exceptionHandler.handle(e);
    }
  }

  private void checkPending()  {
    if (emitting || failed) {
      return;
    }
    emitting = true;
    try {
      do {
        pushed = false;
        while (demand > 0L) {
          T t = mapper.poll();
          if (t == null) {
            break;
          }
          if (demand != Long.MAX_VALUE) {
            --demand;
          }
          if (eventHandler != null) {
            eventHandler.handle(t);
          }
        }
        if (ended) {
          if (demand > 0L) {
            Handler<Void> handler = endHandler;
            endHandler = null;
            if (handler != null) {
              handler.handle(null);
            }
          }
          return;
        }
        if (demand == 0L) {
          stream.pause();
        } else {
          // may push more elements before returning
          stream.resume();
        }
      } while (pushed && demand > 0L && !failed);
    } catch (Exception e) {
      fail(e);
    } finally {
      emitting = false;
    }
  }

}
