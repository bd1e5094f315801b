package com.hazardhawk.server.ai.inference;

public interface ConnectivityMonitor {

    boolean isConnected();
}
