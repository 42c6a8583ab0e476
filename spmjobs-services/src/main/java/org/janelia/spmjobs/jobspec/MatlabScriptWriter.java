package org.janelia.spmjobs.jobspec;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;

/**
 * Fluent writer for MATLAB code.
 */
public class MatlabScriptWriter {
    private final Writer writer;

    public MatlabScriptWriter(Writer writer) {
        this.writer = writer;
    }

    public MatlabScriptWriter add(String line) {
        return write(line + "\n");
    }

    public MatlabScriptWriter addBlankLine() {
        return write("\n");
    }

    public MatlabScriptWriter comment(String text) {
        return add("% " + text);
    }

    /**
     * Append code that already contains its own line terminators.
     */
    public MatlabScriptWriter addCode(String code) {
        return write(code);
    }

    public MatlabScriptWriter assign(String varName, String expr) {
        return add(varName + " = " + expr + ";");
    }

    public void close() {
        try {
            writer.close();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private MatlabScriptWriter write(String s) {
        try {
            writer.write(s);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return this;
    }
}
