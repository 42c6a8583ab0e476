package org.janelia.spmjobs.jobspec;

import java.io.IOException;
import java.io.Writer;

public class MatlabCodeBlock {
    private final StringBuilder codeBuffer = new StringBuilder();

    public MatlabScriptWriter getCodeWriter() {
         return new MatlabScriptWriter(new Writer() {

             @Override
             public void write(char[] cbuf, int off, int len) throws IOException {
                 codeBuffer.append(cbuf, off, len);
             }

             @Override
             public void flush() throws IOException {
             }

             @Override
             public void close() throws IOException {
             }
         });
    }

    public String toString() {
        return codeBuffer.toString();
    }
}
