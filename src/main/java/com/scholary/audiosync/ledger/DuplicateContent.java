package com.scholary.audiosync.ledger;

import com.scholary.audiosync.fingerprint.ContentFingerprint;
import java.util.List;

/** Content that was delivered successfully more than once, under one or more names. */
public record DuplicateContent(
    ContentFingerprint fingerprint, int deliveries, List<String> fileNames, long totalBytes) {

  public DuplicateContent {
    fileNames = fileNames != null ? List.copyOf(fileNames) : List.of();
  }
}
