package me.golemcore.quill;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import static org.junit.jupiter.api.Assertions.assertNotNull;

class QuillApplicationTests {

    @Test
    void shouldHaveExpectedSpringAnnotations() {
        assertNotNull(QuillApplication.class.getAnnotation(SpringBootApplication.class));
        assertNotNull(QuillApplication.class.getAnnotation(ConfigurationPropertiesScan.class));
    }

    @Test
    void shouldExposeMainMethod() throws NoSuchMethodException {
        assertNotNull(QuillApplication.class.getMethod("main", String[].class));
    }
}
