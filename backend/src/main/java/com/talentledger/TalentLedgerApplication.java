package com.talentledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

@SpringBootApplication
@EnableMongoRepositories(basePackages = "com.talentledger.domain")
public class TalentLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(TalentLedgerApplication.class, args);
    }
}
