package io.graphqlsse.json.spi;

/**
 * ServiceLoader hook for {@link JsonCodec} implementations.
 *
 * <p>Implementations are registered in {@code META-INF/services/io.graphqlsse.json.spi.JsonCodecProvider}.
 */
public interface JsonCodecProvider {

    JsonCodec codec();
}
