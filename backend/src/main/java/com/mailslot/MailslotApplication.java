package com.mailslot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.cassandra.CassandraAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

// The Cassandra driver is on the classpath for its UUID utilities only; no session is wanted.
@SpringBootApplication(exclude = CassandraAutoConfiguration.class)
@ConfigurationPropertiesScan
public class MailslotApplication {

    public static void main(String[] args) {
        SpringApplication.run(MailslotApplication.class, args);
    }
}
