package io.paxbridge.tools.utils;

public class ConsolePrinter implements MessagePrinter {
    @Override
    public void print(String msg) {
        System.out.println(msg);
    }
}
