package com.lottoharvest.infrastructure.normalize;

import com.lottoharvest.domain.model.StructuredRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RegionResolver.
 */
class RegionResolverTest {

    private final RegionResolver resolver = new RegionResolver(List.of(
        new RegionDefinition("SEOUL", List.of("Seoul", "서울", "서울특별시")),
        new RegionDefinition("BUSAN", List.of("부산", "부산광역시")),
        new RegionDefinition("GYEONGGI", List.of("경기", "경기도")),
        new RegionDefinition("JEONBUK", List.of("전북", "전라북도", "전북특별자치도"))
    ));

    @Test
    void testLeadingTokenGivesRegionAndSubRegion() {
        RegionResolver.Resolution resolution = resolver.resolve("Seoul Gangnam-district 123 street");

        assertEquals("SEOUL", resolution.regionCode());
        assertEquals("Gangnam-district", resolution.subRegionCode());
    }

    @Test
    void testLongFormLeadingToken() {
        RegionResolver.Resolution resolution = resolver.resolve("서울특별시 강남구 테헤란로 1");

        assertEquals("SEOUL", resolution.regionCode());
        assertEquals("강남구", resolution.subRegionCode());
    }

    @Test
    void testLeadingTokenPrefix() {
        assertEquals("SEOUL", resolver.resolve("서울시 마포구 합정동 3").regionCode());
        assertEquals("JEONBUK", resolver.resolve("전북특별자치도 전주시 완산구").regionCode());
    }

    @Test
    void testLaterTokenWhenLeadingTokenIsNoise() {
        RegionResolver.Resolution resolution = resolver.resolve("(주)로또 부산 해운대구 우동 2");

        assertEquals("BUSAN", resolution.regionCode());
        assertEquals("해운대구", resolution.subRegionCode());
    }

    @Test
    void testLongFormNameInsideUnspacedText() {
        RegionResolver.Resolution resolution = resolver.resolve("대한민국전라북도전주시");

        assertEquals("JEONBUK", resolution.regionCode());
        assertEquals("", resolution.subRegionCode());
    }

    @Test
    void testShortAliasIsNotMatchedInsideWords() {
        assertEquals(StructuredRecord.UNCLASSIFIED, resolver.resolve("중앙서울로 1").regionCode());
    }

    @Test
    void testUnknownTextIsUnclassified() {
        assertEquals(RegionResolver.Resolution.UNCLASSIFIED, resolver.resolve("해외 어딘가"));
        assertEquals(RegionResolver.Resolution.UNCLASSIFIED, resolver.resolve(""));
        assertEquals(RegionResolver.Resolution.UNCLASSIFIED, resolver.resolve(null));
    }
}
