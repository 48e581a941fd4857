package com.lottoharvest.infrastructure.scraper.dhlottery;

import java.util.List;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the newest round number out of a results page. Markers are tried in order:
 * a script variable, a hidden input, then the "N회 당첨결과" heading.
 */
public final class LatestRoundPageParser {

    private static final List<Pattern> MARKERS = List.of(
        Pattern.compile("lottoDrwNo\\s*=\\s*[\"']?(\\d{1,6})"),
        Pattern.compile("id=[\"']lottoDrwNo[\"'][^>]*value=[\"'](\\d{1,6})[\"']"),
        Pattern.compile("(\\d{1,6})\\s*회(?:\\s|<[^>]*>)*당첨결과")
    );

    private LatestRoundPageParser() {
    }

    public static OptionalInt parse(String html) {
        if (html == null || html.isEmpty()) {
            return OptionalInt.empty();
        }
        for (Pattern marker : MARKERS) {
            Matcher m = marker.matcher(html);
            if (m.find()) {
                int round = Integer.parseInt(m.group(1));
                if (round > 0) {
                    return OptionalInt.of(round);
                }
            }
        }
        return OptionalInt.empty();
    }
}
