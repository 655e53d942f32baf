package com.freelance.jobalerts.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.freelance.jobalerts.pipeline.notify.LoggingMessagingChannel;
import com.freelance.jobalerts.pipeline.notify.MessagingChannel;
import com.freelance.jobalerts.pipeline.notify.SendThrottle;
import com.freelance.jobalerts.pipeline.notify.TelegramMessagingChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class AlertsConfig {
    private static final Logger log = LoggerFactory.getLogger(AlertsConfig.class);

    @Bean(name = "sourceExecutor", destroyMethod = "shutdown")
    public ExecutorService sourceExecutor(AlertsProperties properties) {
        int size = Math.max(2, properties.getSources().size());
        return Executors.newFixedThreadPool(size);
    }

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(AlertsProperties properties) {
        int size = Math.max(4, properties.getSources().size() * 2);
        return Executors.newFixedThreadPool(size);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public SendThrottle sendThrottle(AlertsProperties properties) {
        return SendThrottle.threadSleeping(properties.getDelivery().getMinSendIntervalMs());
    }

    @Bean(destroyMethod = "close")
    public MessagingChannel messagingChannel(AlertsProperties properties, ObjectMapper objectMapper) {
        if (!properties.getTelegram().hasBotToken()) {
            log.warn("No Telegram bot token configured, alerts are only logged");
            return new LoggingMessagingChannel();
        }
        return new TelegramMessagingChannel(properties.getTelegram(), objectMapper);
    }
}
