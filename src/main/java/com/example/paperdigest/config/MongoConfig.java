package com.example.paperdigest.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.MongoDatabaseFactory;
import org.springframework.data.mongodb.core.SimpleMongoClientDatabaseFactory;

/**
 * Binds the archive database from the connection string, database name included.
 */
@Configuration
public class MongoConfig {

    @Bean
    public MongoDatabaseFactory mongoDatabaseFactory(
            @Value("${spring.data.mongodb.uri:mongodb://localhost:27017/paper_digest}") String uri) {
        return new SimpleMongoClientDatabaseFactory(uri);
    }
}
