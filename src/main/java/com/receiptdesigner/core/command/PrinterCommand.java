package com.receiptdesigner.core.command;

/**
 * One printer-agnostic drawing instruction produced by the interpreter.
 */
public interface PrinterCommand {

    /**
     * Stable lower-case name used in listings and JSON output.
     */
    String name();
}
