package io.doat4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.doat4j.DoAt;
import io.doat4j.Messenger;
import io.doat4j.discord.DiscordMessenger;
import io.doat4j.discord.DiscordProperties;
import io.doat4j.internal.mongo.MongoAlarmClock;
import io.doat4j.internal.mongo.MongoDoAt;
import io.doat4j.internal.mongo.MongoTenantStorage;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Clock;

/**
 * Spring Boot auto-configuration entrypoint for DoAt components.
 *
 * <p>A {@link Messenger} bean must be available: either supplied by the application or the
 * built-in {@link DiscordMessenger}, which is created when {@code doat.discord.bot-token} is set.
 */
@AutoConfiguration
@ConditionalOnClass({DoAt.class, MongoTemplate.class})
@EnableConfigurationProperties({DoAtProperties.class, DiscordProperties.class})
@ConditionalOnProperty(prefix = "doat", name = "enabled", havingValue = "true", matchIfMissing = true)
public class DoAtConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock doAtClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    protected MongoTenantStorage mongoTenantStorage(MongoTemplate mongoTemplate) {
        return new MongoTenantStorage(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    protected MongoAlarmClock mongoAlarmClock(MongoTemplate mongoTemplate, Clock clock) {
        return new MongoAlarmClock(mongoTemplate, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    protected DoAtMongoIndexConfig doAtMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new DoAtMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean(Messenger.class)
    @ConditionalOnProperty(prefix = "doat.discord", name = "bot-token")
    public DiscordMessenger discordMessenger(DiscordProperties props, ObjectProvider<ObjectMapper> objectMapper) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) props.getConnectTimeout().toMillis());
        requestFactory.setReadTimeout((int) props.getReadTimeout().toMillis());
        RestClient restClient = RestClient.builder()
                .baseUrl(props.getApiBaseUrl())
                .requestFactory(requestFactory)
                .build();
        return new DiscordMessenger(restClient, objectMapper.getIfAvailable(ObjectMapper::new), props.getBotToken());
    }

    @Bean
    @ConditionalOnMissingBean
    public DoAt doAt(DoAtProperties props,
                     MongoTenantStorage storage,
                     MongoAlarmClock alarmClock,
                     ObjectProvider<Messenger> messenger,
                     Clock clock) {
        Messenger m = messenger.getIfAvailable();
        if (m == null) {
            throw new IllegalStateException("No Messenger bean found; define one or set doat.discord.bot-token");
        }
        return new MongoDoAt(props, storage, alarmClock, m, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public DoAtLifecycle doAtLifecycle(DoAt doAt) {
        return new DoAtLifecycle(doAt);
    }

    @Bean
    @ConditionalOnProperty(prefix = "doat", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton doAtIndexesInitializer(DoAtMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }
}
