package com.harmoniq.app;

import com.harmoniq.app.config.FlowProperties;
import com.harmoniq.app.dto.flow.Period;
import com.harmoniq.app.scheduler.FlowScheduler;
import com.harmoniq.app.service.LibraryCatalog;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class HarmoniqApplicationTest {

    @Autowired
    private ApplicationContext context;

    @Autowired
    private FlowProperties flowProperties;

    @Test
    void contextLoadsWithTestConfiguration() {
        assertThat(context.getBean(LibraryCatalog.class)).isNotNull();
        assertThat(context.getBeansOfType(FlowScheduler.class)).isEmpty();
        assertThat(flowProperties.getPlaylistName()).isEqualTo("Test Flow");
        assertThat(flowProperties.getPeriods()).extracting(Period::getName)
                .containsExactly("Morning", "Evening", "Night");
    }
}
