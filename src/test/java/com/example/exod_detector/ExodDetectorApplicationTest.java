package com.example.exod_detector;

import com.example.exod_detector.engine.Interfaces.SkyCoordinateResolver;
import com.example.exod_detector.engine.NoopSkyCoordinateResolver;
import com.example.exod_detector.service.VariabilityDetectionService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = "detector.runner.enabled=false")
@ActiveProfiles("test")
class ExodDetectorApplicationTest {

    @Autowired
    private ApplicationContext context;

    @Test
    void contextWiresTheDetectionPipeline() {
        assertThat(context.getBean(VariabilityDetectionService.class)).isNotNull();
        assertThat(context.getBean(SkyCoordinateResolver.class)).isInstanceOf(NoopSkyCoordinateResolver.class);
        assertThat(context.containsBean("tileTaskExecutor")).isTrue();
        assertThat(context.getBeanNamesForType(org.springframework.boot.CommandLineRunner.class)).isEmpty();
    }
}
