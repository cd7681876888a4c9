package com.fintech.scanner.publish;

import com.fintech.scanner.domain.PerformerEvent;

/**
 * Consumer of finalized per-minute results. Implementations own their state and
 * concurrency; they receive an immutable event and cannot reach back into the scanner.
 */
public interface PerformerEventListener {

    void onPerformer(PerformerEvent event);
}
