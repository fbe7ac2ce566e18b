package com.genderai.server.config;

import com.genderai.server.model.LoadException;
import com.genderai.server.model.ModelLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Starts loading the models as soon as the application is up, so the first
 * request does not pay for it. Failures are recorded by the loader and retried
 * on demand.
 */
@Component
public class ModelWarmup {

    private static final Logger logger = LoggerFactory.getLogger(ModelWarmup.class);

    private final ModelLoader modelLoader;
    private final GenderProperties properties;

    public ModelWarmup(ModelLoader modelLoader, GenderProperties properties) {
        this.modelLoader = modelLoader;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        if (!properties.getModel().isEagerLoad()) {
            logger.info("Eager model loading disabled; models load on first request");
            return;
        }
        Thread warmup = new Thread(() -> {
            try {
                modelLoader.ensureReady();
                logger.info("Models are ready for classification.");
            } catch (LoadException e) {
                logger.warn("Eager model load failed ({}); will retry on demand", e.getKind());
            }
        }, "model-warmup");
        warmup.setDaemon(true);
        warmup.start();
    }
}
