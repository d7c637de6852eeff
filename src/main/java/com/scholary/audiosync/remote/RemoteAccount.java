package com.scholary.audiosync.remote;

/** Who and where we are connected to, for status output. */
public record RemoteAccount(String identity, String description) {}
