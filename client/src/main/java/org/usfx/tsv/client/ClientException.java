package org.usfx.tsv.client;

public class ClientException extends RuntimeException {

  public ClientException(String msg) {
    super(msg);
  }
}
