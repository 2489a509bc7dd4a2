package io.twin4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.twin4j.DigitalTwin;
import io.twin4j.Unit;
import io.twin4j.UnitEventListener;
import io.twin4j.database.DatabaseAdapter;
import io.twin4j.internal.DefaultDigitalTwin;
import io.twin4j.internal.JobStore;
import io.twin4j.internal.mongo.GridFsStorageService;
import io.twin4j.internal.mongo.MongoDatabaseAdapter;
import io.twin4j.internal.mongo.MongoJobStore;
import io.twin4j.storage.StorageService;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Clock;
import java.util.List;

/**
 * Spring Boot auto-configuration entrypoint for the digital twin engine.
 *
 * <p>Every bean backs off when the application defines its own, so the Mongo job store, record
 * store or blob store can be swapped independently.
 */
@AutoConfiguration
@ConditionalOnClass({DigitalTwin.class, MongoTemplate.class})
@EnableConfigurationProperties(TwinProperties.class)
@ConditionalOnProperty(prefix = "twin", name = "enabled", havingValue = "true", matchIfMissing = true)
public class TwinConfig {

    @Bean
    @ConditionalOnMissingBean
    protected JobStore twinJobStore(MongoTemplate mongoTemplate) {
        return new MongoJobStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    protected StorageService twinStorageService(MongoTemplate mongoTemplate, TwinProperties props) {
        TwinProperties.Storage storage = props.getStorage();
        return new GridFsStorageService(mongoTemplate, storage.getBucket(), storage.getPublicBaseUrl(), Clock.systemUTC());
    }

    @Bean
    @ConditionalOnMissingBean
    protected DatabaseAdapter twinDatabaseAdapter(MongoTemplate mongoTemplate, StorageService storage) {
        return new MongoDatabaseAdapter(mongoTemplate, storage);
    }

    @Bean
    @ConditionalOnMissingBean
    protected TwinMongoIndexConfig twinMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new TwinMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public DigitalTwin digitalTwin(TwinProperties props,
                                   ObjectProvider<List<Unit>> unitsProvider,
                                   ObjectProvider<List<UnitEventListener>> listenersProvider,
                                   DatabaseAdapter database,
                                   StorageService storage,
                                   JobStore jobStore,
                                   ObjectProvider<ObjectMapper> objectMapper) {
        List<Unit> units = unitsProvider.getIfAvailable(List::of);
        DefaultDigitalTwin twin = new DefaultDigitalTwin(
                props, units, database, storage, jobStore, objectMapper.getIfAvailable(ObjectMapper::new)
        );
        listenersProvider.getIfAvailable(List::of).forEach(twin::addEventListener);
        return twin;
    }

    @Bean
    @ConditionalOnMissingBean
    public TwinLifecycle twinLifecycle(DigitalTwin digitalTwin, TwinProperties props) {
        return new TwinLifecycle(digitalTwin, props.isAutoStartup());
    }

    @Bean
    @ConditionalOnProperty(prefix = "twin", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton twinIndexesInitializer(TwinMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }
}
