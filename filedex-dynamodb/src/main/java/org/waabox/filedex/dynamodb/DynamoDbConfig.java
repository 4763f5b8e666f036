package org.waabox.filedex.dynamodb;

import java.net.URI;
import java.util.Objects;
import java.util.Optional;

import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.DynamoDbClientBuilder;

/**
 * Immutable configuration of the DynamoDB backend.
 *
 * <p>Holds the AWS region, an optional endpoint override (for local
 * DynamoDB), the prefix of the table names and an optional pre-built
 * {@link DynamoDbClient}. When no client is provided the stores build
 * one from the region and endpoint, and close it on {@code close()}.
 *
 * <p>Instances are created via the {@link Builder} returned by
 * {@link #builder()}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class DynamoDbConfig {

  /** Default table name prefix. */
  private static final String DEFAULT_TABLE_PREFIX = "filedex_";

  /** The AWS region, never null. */
  private final Region region;

  /** The endpoint override, may be null. */
  private final URI endpoint;

  /** The table name prefix, never null. */
  private final String tablePrefix;

  /** An optional pre-built client, may be null. */
  private final DynamoDbClient client;

  /** Creates a config from the builder.
   *
   * @param builder the builder to construct from, never null
   */
  private DynamoDbConfig(final Builder builder) {
    region = Objects.requireNonNull(builder.region,
        "region must not be null");
    endpoint = builder.endpoint;
    tablePrefix = builder.tablePrefix != null
        ? builder.tablePrefix : DEFAULT_TABLE_PREFIX;
    client = builder.client;
  }

  /**
   * Returns the AWS region.
   *
   * @return the region, never null
   */
  public Region region() {
    return region;
  }

  /**
   * Returns the endpoint override.
   *
   * @return the endpoint, empty for the regional AWS endpoint
   */
  public Optional<URI> endpoint() {
    return Optional.ofNullable(endpoint);
  }

  /**
   * Returns the table name prefix, {@code filedex_} by default.
   *
   * @return the prefix, never null
   */
  public String tablePrefix() {
    return tablePrefix;
  }

  /**
   * Returns the full name of a table.
   *
   * @param table the table name without prefix, never null
   *
   * @return the prefixed name, never null
   */
  public String tableName(final String table) {
    return tablePrefix + table;
  }

  /**
   * Returns the optional pre-built client.
   *
   * @return the client if provided, or empty
   */
  public Optional<DynamoDbClient> client() {
    return Optional.ofNullable(client);
  }

  /**
   * Builds a client from the region and endpoint.
   *
   * @return a new client, never null
   */
  DynamoDbClient buildClient() {
    final DynamoDbClientBuilder builder = DynamoDbClient.builder()
        .region(region);
    if (endpoint != null) {
      builder.endpointOverride(endpoint);
    }
    return builder.build();
  }

  /**
   * Creates a new builder.
   *
   * @return a new builder instance, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * A builder for {@link DynamoDbConfig} instances.
   *
   * <p>Required: {@code region}. Optional: {@code endpoint},
   * {@code tablePrefix} and {@code client}.
   *
   * @author waabox(waabox[at]gmail[dot]com)
   */
  public static final class Builder {

    /** The AWS region. */
    private Region region;

    /** The endpoint override. */
    private URI endpoint;

    /** The table name prefix. */
    private String tablePrefix;

    /** The optional pre-built client. */
    private DynamoDbClient client;

    /** Private constructor, use {@link DynamoDbConfig#builder()}. */
    private Builder() {
    }

    /**
     * Sets the AWS region.
     *
     * @param theRegion the region, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder region(final Region theRegion) {
      region = theRegion;
      return this;
    }

    /**
     * Sets an endpoint override, e.g. a local DynamoDB.
     *
     * @param theEndpoint the endpoint, may be null for the AWS default
     *
     * @return this builder for chaining, never null
     */
    public Builder endpoint(final URI theEndpoint) {
      endpoint = theEndpoint;
      return this;
    }

    /**
     * Sets the table name prefix.
     *
     * @param thePrefix the prefix, may be null for {@code filedex_}
     *
     * @return this builder for chaining, never null
     */
    public Builder tablePrefix(final String thePrefix) {
      tablePrefix = thePrefix;
      return this;
    }

    /**
     * Sets a pre-built client. The stores will not close it.
     *
     * @param theClient the client, may be null
     *
     * @return this builder for chaining, never null
     */
    public Builder client(final DynamoDbClient theClient) {
      client = theClient;
      return this;
    }

    /**
     * Builds the configuration.
     *
     * @return the configuration, never null
     *
     * @throws NullPointerException if the region is missing
     */
    public DynamoDbConfig build() {
      return new DynamoDbConfig(this);
    }
  }
}
