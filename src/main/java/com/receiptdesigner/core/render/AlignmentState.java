package com.receiptdesigner.core.render;

import com.receiptdesigner.core.model.Alignment;

import java.util.Objects;

/**
 * The single "current alignment" value threaded through a render pass. One instance tracks the
 * document; each item template gets its own so template directives never leak back.
 */
public final class AlignmentState {
    private Alignment current = Alignment.LEFT;

    public Alignment current() {
        return current;
    }

    public void set(Alignment alignment) {
        this.current = Objects.requireNonNull(alignment, "alignment");
    }
}
