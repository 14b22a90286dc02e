package com.example.tokendatasource.core.secrets;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Database secret payload as stored in AWS Secrets Manager.
 *
 * <p>Fields map to the common RDS secret JSON structure; unknown fields are ignored.
 *
 * @param username database username
 * @param password database password
 * @param engine database engine identifier (e.g., postgres)
 * @param host database host name or address
 * @param port database port number
 * @param dbname database name
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DatabaseSecret(
    String username, String password, String engine, String host, int port, String dbname) {}
