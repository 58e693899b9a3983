package io.github.drompincen.todolist.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.todolist")
@EnableMongoRepositories(basePackages = "io.github.drompincen.todolist.persistence.repository")
@ConfigurationPropertiesScan(basePackages = "io.github.drompincen.todolist.runtime")
public class TodoListApplication {

    public static void main(String[] args) {
        SpringApplication.run(TodoListApplication.class, args);
    }
}
