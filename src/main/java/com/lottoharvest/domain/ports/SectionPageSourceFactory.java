package com.lottoharvest.domain.ports;

/**
 * Opens a page source with its own network client.
 */
@FunctionalInterface
public interface SectionPageSourceFactory {

    SectionPageSource open();
}
