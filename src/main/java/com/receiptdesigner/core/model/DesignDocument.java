package com.receiptdesigner.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Ordered, immutable list of receipt elements. The order is both paint order and the path
 * along which the ambient alignment propagates.
 */
public final class DesignDocument {
    private final List<ReceiptElement> elements;

    public DesignDocument(List<? extends ReceiptElement> elements) {
        Objects.requireNonNull(elements, "elements");
        this.elements = List.copyOf(elements);
    }

    public static DesignDocument of(ReceiptElement... elements) {
        return new DesignDocument(List.of(elements));
    }

    public List<ReceiptElement> elements() {
        return elements;
    }

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    /**
     * Alignment in effect for the element at {@code index}, found by scanning backward for the
     * nearest {@code align} element. This is the editor-side formulation; the interpreter keeps a
     * running value instead and both must agree.
     *
     * @param index element position, {@code 0 <= index <= size()}; {@code size()} asks for the
     *              alignment after the last element
     */
    public Alignment effectiveAlignmentAt(int index) {
        if (index < 0 || index > elements.size()) {
            throw new IndexOutOfBoundsException("index " + index + " outside 0.." + elements.size());
        }
        for (int i = index - 1; i >= 0; i--) {
            if (elements.get(i) instanceof AlignElement align) {
                return align.alignment();
            }
        }
        return Alignment.LEFT;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DesignDocument other)) return false;
        return elements.equals(other.elements);
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }

    @Override
    public String toString() {
        return "DesignDocument" + elements;
    }
}
