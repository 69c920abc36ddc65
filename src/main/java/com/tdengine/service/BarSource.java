package com.tdengine.service;

import com.tdengine.domain.model.Bar;
import java.util.List;

/**
 * Supplies the ordered bar series of one instrument.
 *
 * <p>Ingestion, caching and persistence live behind this interface; the engine only ever
 * sees the returned list, oldest bar first.
 */
@FunctionalInterface
public interface BarSource {

    List<Bar> loadBars(String symbol);
}
