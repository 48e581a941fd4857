package com.lottoharvest.domain.ports;

import com.lottoharvest.domain.exception.FetchException;
import com.lottoharvest.domain.model.FetchedDocument;
import com.lottoharvest.domain.model.Section;

import java.io.Closeable;

/**
 * Port fetching the pages of a section. One instance serves one worker.
 */
public interface SectionPageSource extends Closeable {

    /**
     * @param page 1-based page number
     */
    FetchedDocument fetchPage(Section section, int page) throws FetchException;

    @Override
    default void close() {
    }
}
