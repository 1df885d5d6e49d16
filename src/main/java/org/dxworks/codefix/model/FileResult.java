package org.dxworks.codefix.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Report line for one file that was rewritten or that carries diagnostics.
 */
public class FileResult {
    public String kind = "file";
    public String filePath;
    public String language;
    public boolean changed;
    public boolean written;
    public int rewrites;
    public int literalRewrites;
    public int substitutions;
    public List<String> insertedHelpers = new ArrayList<>();
    public List<Diagnostic> diagnostics = new ArrayList<>();
}
