package com.lottoharvest.infrastructure.scraper.dhlottery;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lottoharvest.domain.exception.DecodeException;
import com.lottoharvest.domain.exception.FetchException;
import com.lottoharvest.domain.model.DrawResult;
import com.lottoharvest.domain.model.ProbeResult;
import com.lottoharvest.domain.ports.DrawResultSource;
import com.lottoharvest.domain.ports.FetchClient;
import com.lottoharvest.domain.ports.RoundProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads the JSON draw API. A round exists when the API answers
 * {@code returnValue = "success"} for that very round number.
 *
 * <p>The API answers HTML instead of JSON when it blocks a client; such an answer is
 * reported as {@link ProbeResult#UNKNOWN} so that it is never mistaken for an absent round.
 */
public class DhLotteryRoundProbe implements RoundProbe, DrawResultSource {

    private static final Logger logger = LoggerFactory.getLogger(DhLotteryRoundProbe.class);
    private static final String SUCCESS = "success";
    private static final int MAIN_NUMBERS = 6;

    private final FetchClient client;
    private final DhLotteryEndpoints endpoints;
    private final ObjectMapper objectMapper;

    public DhLotteryRoundProbe(FetchClient client, DhLotteryEndpoints endpoints, ObjectMapper objectMapper) {
        this.client = client;
        this.endpoints = endpoints;
        this.objectMapper = objectMapper;
    }

    @Override
    public ProbeResult probe(int round) {
        try {
            JsonNode response = fetchJson(round);
            if (isPublished(response, round)) {
                return ProbeResult.EXISTS;
            }
            if (response.has("returnValue")) {
                return ProbeResult.ABSENT;
            }
            logger.warn("Draw API answered without returnValue for round {}", round);
            return ProbeResult.UNKNOWN;
        } catch (FetchException e) {
            logger.warn("Probe of round {} failed: {}", round, e.getMessage());
            return ProbeResult.UNKNOWN;
        }
    }

    @Override
    public Optional<DrawResult> fetchDraw(int round) throws FetchException {
        JsonNode response = fetchJson(round);
        if (!isPublished(response, round)) {
            return Optional.empty();
        }
        List<Integer> numbers = new ArrayList<>(MAIN_NUMBERS);
        for (int i = 1; i <= MAIN_NUMBERS; i++) {
            JsonNode n = response.get("drwtNo" + i);
            if (n == null || !n.canConvertToInt()) {
                throw new DecodeException("Draw of round " + round + " lacks drwtNo" + i, endpoints.apiUrl(round));
            }
            numbers.add(n.asInt());
        }
        JsonNode bonus = response.get("bnusNo");
        return Optional.of(new DrawResult(round, numbers, bonus != null && bonus.canConvertToInt() ? bonus.asInt() : null));
    }

    private JsonNode fetchJson(int round) throws FetchException {
        String url = endpoints.apiUrl(round);
        String body = client.get(url).text();
        try {
            JsonNode node = objectMapper.readTree(body);
            if (node == null || !node.isObject()) {
                throw new DecodeException("Draw API answered a non-object", url);
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new DecodeException("Draw API answered non-JSON: " + e.getOriginalMessage(), url, e);
        }
    }

    private static boolean isPublished(JsonNode response, int round) {
        return SUCCESS.equals(response.path("returnValue").asText())
            && response.path("drwNo").asInt(-1) == round;
    }
}
