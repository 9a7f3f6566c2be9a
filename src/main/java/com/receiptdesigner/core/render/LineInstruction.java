package com.receiptdesigner.core.render;

import com.receiptdesigner.core.model.Alignment;

import java.util.Objects;

/**
 * Output of {@link DirectiveLineParser}: what one item-template line asks the renderer to do.
 */
public interface LineInstruction {

    record AlignInstruction(Alignment alignment) implements LineInstruction {
        public AlignInstruction {
            Objects.requireNonNull(alignment, "alignment");
        }
    }

    record FeedInstruction(int lines) implements LineInstruction {
    }

    record TextInstruction(String text) implements LineInstruction {
        public TextInstruction {
            Objects.requireNonNull(text, "text");
        }
    }
}
