package com.openforge.agentmemory.embedding;

import java.util.List;

/**
 * Maps text to a fixed-length vector.
 *
 * Implementations throw {@link com.openforge.agentmemory.exception.UpstreamException}
 * when the model cannot be reached, and
 * {@link com.openforge.agentmemory.exception.ConfigurationException} when the
 * returned vector does not have {@link #dimensions()} elements.
 */
public interface EmbeddingGateway {

    List<Float> embed(String text);

    int dimensions();

    String modelName();
}
