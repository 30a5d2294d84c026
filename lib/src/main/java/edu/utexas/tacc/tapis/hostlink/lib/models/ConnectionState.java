package edu.utexas.tacc.tapis.hostlink.lib.models;

/*
 * CONNECTED    - socket present and the master answers
 * STALE        - socket present but the master does not answer
 * DISCONNECTED - no socket
 */
public enum ConnectionState {CONNECTED, STALE, DISCONNECTED}
