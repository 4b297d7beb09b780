package com.theset.setlist.application.sync;

import com.theset.setlist.domain.model.WriteOutcome;

/**
 * One attempt of a fallback write chain.
 */
@FunctionalInterface
public interface WriteStrategy<T> {

    WriteOutcome<T> write(T record);
}
