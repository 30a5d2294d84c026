package edu.utexas.tacc.tapis.hostlink.lib.models;

public enum ConnectOutcome {REUSED, ESTABLISHED}
