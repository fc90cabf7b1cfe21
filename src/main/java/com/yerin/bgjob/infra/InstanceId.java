package com.yerin.bgjob.infra;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.UUID;

public final class InstanceId {
    private InstanceId() {}

    public static String generate() {
        try {
            return InetAddress.getLocalHost().getHostName() + "-" + UUID.randomUUID();
        } catch (UnknownHostException e) {
            return "instance-" + UUID.randomUUID();
        }
    }
}
