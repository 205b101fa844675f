package me.zooventory.feeding;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import static org.junit.jupiter.api.Assertions.assertNotNull;

class ZooventoryFeedingApplicationTests {

    @Test
    void shouldHaveExpectedSpringAnnotations() {
        assertNotNull(ZooventoryFeedingApplication.class.getAnnotation(SpringBootApplication.class));
        assertNotNull(ZooventoryFeedingApplication.class.getAnnotation(ConfigurationPropertiesScan.class));
    }

    @Test
    void shouldExposeMainMethod() throws NoSuchMethodException {
        assertNotNull(ZooventoryFeedingApplication.class.getMethod("main", String[].class));
    }
}
