package com.scholary.audiosync.remote;

import com.scholary.audiosync.fingerprint.ContentFingerprint;

/** An object in the remote store. {@code fingerprint} is null when the store has none recorded. */
public record RemoteObject(String id, String name, long size, ContentFingerprint fingerprint) {}
