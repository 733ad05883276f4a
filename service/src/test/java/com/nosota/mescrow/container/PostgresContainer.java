package com.nosota.mescrow.container;

import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.utility.DockerImageName;

/**
 * Shared PostgreSQL container, started on first use.
 */
public class PostgresContainer extends PostgreSQLContainer<PostgresContainer> {

    private static final DockerImageName DOCKER_IMAGE = DockerImageName.parse("postgres:16.6")
            .asCompatibleSubstituteFor("postgres");

    private static PostgresContainer instance;

    private PostgresContainer() {
        super(DOCKER_IMAGE);
        withDatabaseName("mescrow");
        withCommand("postgres", "-c", "log_statement=all", "-c", "log_destination=stderr");
        start();
    }

    public static synchronized PostgresContainer getInstance() {
        if (instance == null) {
            instance = new PostgresContainer();
        }
        return instance;
    }
}
