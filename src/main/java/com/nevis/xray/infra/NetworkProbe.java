package com.nevis.xray.infra;

public interface NetworkProbe {

    /**
     * @return true when general internet connectivity is available
     */
    boolean isOnline();
}
