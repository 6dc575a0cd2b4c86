package net.deckforge;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

import net.deckforge.config.DeckForgeProperties;
import net.deckforge.service.image.OpenAiImageGenerator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Context smoke test. The runner sees no arguments here, so it only reports a usage error.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE, properties = {
    "deckforge.openai.api-key=" + DeckForgeApplication.AI_KEY_NOT_CONFIGURED,
    "deckforge.worker-count=3",
    "deckforge.build-root=target/test-builds"
})
class DeckForgeApplicationTests {

    @Autowired
    private DeckForgeProperties properties;

    @Autowired
    @Qualifier("assetMaterializerExecutor")
    private AsyncTaskExecutor assetMaterializerExecutor;

    @Autowired
    private OpenAiImageGenerator imageGenerator;

    @Test
    void contextLoads() {
        // Passes if every bean wires up
    }

    @Test
    void should_BindDeckForgeProperties_FromConfiguration() {
        assertEquals("target/test-builds", properties.getBuildRoot());
        assertEquals("assets_generated", properties.getAssetDirectory());
        assertEquals(3, properties.getGeneration().getMaxAttempts());
        assertEquals(3, properties.getWorkerCount());
    }

    @Test
    void should_SizeMaterializerPool_FromWorkerCount() {
        ThreadPoolTaskExecutor executor = assertInstanceOf(ThreadPoolTaskExecutor.class, assetMaterializerExecutor);

        assertEquals(3, executor.getMaxPoolSize());
        assertEquals("asset-worker-", executor.getThreadNamePrefix());
    }

    @Test
    void should_DisableGenerator_When_NoApiKeyConfigured() {
        assertFalse(imageGenerator.isAvailable());
    }
}
