package io.github.drompincen.toolguard.protocol.api;

/** A blank or missing message leaves the accepted changes as unstaged modifications. */
public record AcceptSessionRequest(String commitMessage) {}
