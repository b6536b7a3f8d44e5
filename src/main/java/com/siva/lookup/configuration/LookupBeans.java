// configuration/LookupBeans.java
package com.siva.lookup.configuration;

import com.siva.lookup.database.MongoDataSource;
import com.siva.lookup.repo.InMemoryLookupStore;
import com.siva.lookup.repo.LookupStore;
import com.siva.lookup.repo.MongoLookupStore;
import com.siva.lookup.service.LookupService;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(LookupProperties.class)
public class LookupBeans {

  @Bean(destroyMethod = "close")
  @ConditionalOnProperty(name = "lookup.store", havingValue = "mongo", matchIfMissing = true)
  public MongoDataSource mongoDataSource() {
    return new MongoDataSource();
  }

  @Bean
  @ConditionalOnProperty(name = "lookup.store", havingValue = "mongo", matchIfMissing = true)
  public LookupStore mongoLookupStore(MongoDataSource ds, LookupProperties props) {
    return new MongoLookupStore(ds, props);
  }

  @Bean
  @ConditionalOnProperty(name = "lookup.store", havingValue = "memory")
  public LookupStore inMemoryLookupStore() {
    return new InMemoryLookupStore();
  }

  @Bean
  public LookupService lookupService(LookupStore store, LookupProperties props) {
    return new LookupService(store, props.lookupTables(), props.isPreload(), props.getWarnSize());
  }
}
