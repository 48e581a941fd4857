package com.lottoharvest.infrastructure.scraper.dhlottery;

import com.lottoharvest.domain.model.Section;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * URLs and form fields of the lottery results site. Templates carry a {@code {round}}
 * placeholder where the round number goes.
 *
 * @param storeUrl  winning-store listing, posted with the round and page as form fields
 * @param byWinUrl  results-by-win page of one round
 * @param latestUrl results-by-win page without a round, showing the newest draw
 * @param apiUrl    JSON draw result of one round
 */
public record DhLotteryEndpoints(String storeUrl, String byWinUrl, String latestUrl, String apiUrl) {

    private static final String ROUND = "{round}";

    /** Game code of the 6/45 draw on the store page. */
    static final String GAME_NO = "5133";

    public static DhLotteryEndpoints defaults() {
        return new DhLotteryEndpoints(
            "https://dhlottery.co.kr/store.do?method=topStore&pageGubun=L645",
            "https://dhlottery.co.kr/gameResult.do?method=byWin&drwNo={round}",
            "https://dhlottery.co.kr/gameResult.do?method=byWin",
            "https://www.dhlottery.co.kr/common.do?method=getLottoNumber&drwNo={round}");
    }

    public String byWinUrl(int round) {
        return byWinUrl.replace(ROUND, String.valueOf(round));
    }

    public String apiUrl(int round) {
        return apiUrl.replace(ROUND, String.valueOf(round));
    }

    /**
     * Form fields selecting one page of a round's store listing.
     */
    public Map<String, String> storeForm(Section section, int page) {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("method", "topStore");
        form.put("nowPage", String.valueOf(page));
        form.put("gameNo", GAME_NO);
        form.put("hdrwComb", "1");
        form.put("drwNo", String.valueOf(section.round()));
        return form;
    }
}
