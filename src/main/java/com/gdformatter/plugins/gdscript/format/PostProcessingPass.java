package com.gdformatter.plugins.gdscript.format;

import java.util.List;

/**
 * A whole-document rewrite run over the rendered lines after the tree walk.
 */
public interface PostProcessingPass {
    List<FormattedLine> apply(List<FormattedLine> lines, Context context);
}
