package com.paperbot.runner;

/**
 * Courtesy delay between upstream queries; replaced in tests.
 */
@FunctionalInterface
public interface Sleeper {
    Sleeper SYSTEM = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
