package com.carillon.core.editor;

import java.util.List;

/**
 * Operator help text.
 */
public final class Instructions {

    public static final List<String> LINES = List.of(
            "- Enter Line# Day(s) Hour(s) Minute and File Name or Strike.",
            "- Separate line# and event parameters with a single space.",
            "- Day is mm/dd/yy, su, mo, tu, we, th, fr, or sa.",
            "- Hour is 24-hour time between 0 and 23.",
            "- Minute is between 0 to 59.  Events play at hh:mm:00.",
            "- Ranges are allowed and inclusive: 0-23 = hourly, su-sa = daily.",
            "- Ranges may not wrap: enter fr-sa and su-mo as two lines.",
            "- Tunes are filenames and are cAsE SeNsiTiVe.",
            "- Line#<enter> to delete a line.",
            "- <enter> to show the schedule.",
            "- ?<enter> to repeat these instructions");

    private Instructions() {
    }
}
