package com.guildshortcuts;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class GuildShortcutsApplication {
    public static void main(String[] args) {
        SpringApplication.run(GuildShortcutsApplication.class, args);
    }
}
