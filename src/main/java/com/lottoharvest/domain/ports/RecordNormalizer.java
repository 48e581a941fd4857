package com.lottoharvest.domain.ports;

import com.lottoharvest.domain.model.ColumnLayout;
import com.lottoharvest.domain.model.RawRow;
import com.lottoharvest.domain.model.Section;
import com.lottoharvest.domain.model.StructuredRecord;

import java.util.Optional;

/**
 * Port turning a raw row into a record, or rejecting it as non-data.
 */
public interface RecordNormalizer {

    Optional<StructuredRecord> normalize(RawRow row, Section section, ColumnLayout layout);
}
