package com.gdformatter.plugins.gdscript.format;

import java.util.ArrayList;
import java.util.List;

/**
 * Final region pass over the whole document: drops blank lines right before
 * an {@code #endregion} and makes sure at least two blank lines separate it
 * from a {@code #region} that follows.
 */
public class RegionSpacingCleanup implements PostProcessingPass {
    static final int BLANK_LINES_BETWEEN_REGIONS = 2;

    @Override
    public List<FormattedLine> apply(List<FormattedLine> lines, Context context) {
        List<FormattedLine> cleaned = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            FormattedLine line = lines.get(i);
            if (!RegionMarkers.closesRegion(line.getText())) {
                cleaned.add(line);
                continue;
            }
            while (!cleaned.isEmpty() && cleaned.get(cleaned.size() - 1).isBlank()) {
                cleaned.remove(cleaned.size() - 1);
            }
            cleaned.add(line);

            int blanks = 0;
            int next = i + 1;
            while (next < lines.size() && lines.get(next).isBlank()) {
                blanks++;
                next++;
            }
            if (next < lines.size() && RegionMarkers.opensRegion(lines.get(next).getText())) {
                for (int missing = BLANK_LINES_BETWEEN_REGIONS - blanks; missing > 0; missing--) {
                    cleaned.add(FormattedLine.blank());
                }
            }
        }
        return cleaned;
    }
}
