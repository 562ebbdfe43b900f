package io.mnemo.cli;

@FunctionalInterface
public interface DaemonRunner {
    int run(boolean consolidateOnStart) throws Exception;
}
