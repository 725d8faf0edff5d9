package io.paxbridge.tools.utils;

public interface MessagePrinter {
    void print(String msg);
}
