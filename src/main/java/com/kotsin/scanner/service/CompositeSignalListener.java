package com.kotsin.scanner.service;

import com.kotsin.scanner.model.CompositeSignal;

/**
 * Receives every emitted signal. Persistence and alerting plug in here.
 *
 * Called on the scanning thread after the emission is recorded; an exception
 * is logged and does not undo the emission.
 */
public interface CompositeSignalListener {
    void onSignal(CompositeSignal signal);
}
