package com.lottoharvest.infrastructure.config;

import com.lottoharvest.domain.model.ColumnLayout;
import com.lottoharvest.domain.model.RawRow;
import com.lottoharvest.domain.model.Section;
import com.lottoharvest.domain.model.StructuredRecord;
import com.lottoharvest.domain.model.Tier;
import com.lottoharvest.infrastructure.normalize.OnlineChannelPredicate;
import com.lottoharvest.infrastructure.normalize.RowNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.ConfigurationPropertySources;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.core.env.PropertySource;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.time.DayOfWeek;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for HarvestProperties bound from the packaged application.yml.
 */
class HarvestPropertiesTest {

    private HarvestProperties properties;

    @BeforeEach
    void setUp() throws IOException {
        List<PropertySource<?>> sources = new YamlPropertySourceLoader()
            .load("application", new ClassPathResource("application.yml"));
        properties = new Binder(ConfigurationPropertySources.from(sources))
            .bind("harvest", HarvestProperties.class)
            .get();
    }

    @Test
    void testBindsRunSettings() {
        assertEquals(10, properties.getWindow());
        assertEquals(Duration.ofMillis(250), properties.getPacingDelay());
        assertEquals(Duration.ofMinutes(10), properties.getRunBudget());
        assertEquals(HarvestProperties.RoundStrategy.PROBE, properties.getRound().getStrategy());
        assertEquals(DayOfWeek.SATURDAY, properties.getRound().getDrawDay());
        assertEquals(List.of(429, 500, 502, 503, 504), properties.getHttp().getRetryableStatuses());
        assertEquals("www.dhlottery.co.kr", properties.getHttp().getFallbackHost());
        assertEquals(OnlineChannelPredicate.Scope.EITHER, properties.getNormalize().getOnlineScope());
    }

    @Test
    void testAllProvincesConfigured() {
        assertEquals(17, properties.getNormalize().getRegions().size());
    }

    @Test
    void testConfiguredNormalizerResolvesRegions() {
        RowNormalizer normalizer = new HarvestConfig().rowNormalizer(properties);
        Section section = new Section(1150, Tier.SECOND);
        ColumnLayout layout = ColumnLayout.positional(Tier.SECOND);

        assertEquals("GANGWON", normalizer.normalize(RawRow.of("1", "복권방", "강원특별자치도 춘천시 중앙로 1"),
            section, layout).orElseThrow().getRegionCode());
        assertEquals("SEJONG", normalizer.normalize(RawRow.of("2", "행운점", "세종특별자치시 한누리대로 2"),
            section, layout).orElseThrow().getRegionCode());
        assertEquals(StructuredRecord.ONLINE, normalizer.normalize(RawRow.of("3", "인터넷 복권판매사이트", "동행복권(dhlottery.co.kr)"),
            section, layout).orElseThrow().getRegionCode());
        assertTrue(normalizer.normalize(RawRow.of("조회 결과가 없습니다."), section, layout).isEmpty());
    }
}
