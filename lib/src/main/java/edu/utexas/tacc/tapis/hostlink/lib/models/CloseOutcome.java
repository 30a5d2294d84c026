package edu.utexas.tacc.tapis.hostlink.lib.models;

/*
 * GRACEFUL - the master accepted the exit request
 * FORCED   - the exit request failed and the socket file was removed directly
 */
public enum CloseOutcome {GRACEFUL, FORCED}
