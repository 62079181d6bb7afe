package com.openforge.agentmemory.vector;

import com.openforge.agentmemory.exception.ConfigurationException;
import com.openforge.agentmemory.exception.UpstreamException;
import com.openforge.agentmemory.memory.MemoryCategory;
import com.openforge.agentmemory.support.FixtureEmbeddingGateway;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("MilvusVectorStore Tests")
class MilvusVectorStoreTest {

    private static final MilvusProperties PROPS = new MilvusProperties(
            false, "localhost", 19530, "", "agent_memories", FixtureEmbeddingGateway.DIMENSIONS, 10_000, "STRONG");

    @Test
    @DisplayName("Should build no expression for an empty filter")
    void shouldBuildNoExpressionForEmptyFilter() {
        assertThat(MilvusVectorStore.filterExpression(VectorFilter.none())).isNull();
        assertThat(MilvusVectorStore.filterExpression(new VectorFilter(" ", null))).isNull();
    }

    @Test
    @DisplayName("Should build equality expressions joined with and")
    void shouldBuildEqualityExpressions() {
        assertThat(MilvusVectorStore.filterExpression(VectorFilter.owner("dev")))
                .isEqualTo("owner == \"dev\"");
        assertThat(MilvusVectorStore.filterExpression(new VectorFilter("dev", MemoryCategory.USER_PROFILE)))
                .isEqualTo("owner == \"dev\" and category == \"user_profile\"");
        assertThat(MilvusVectorStore.filterExpression(new VectorFilter(null, MemoryCategory.DECISION)))
                .isEqualTo("category == \"decision\"");
    }

    @Test
    @DisplayName("Should escape quotes and backslashes in owner values")
    void shouldEscapeOwner() {
        assertThat(MilvusVectorStore.filterExpression(VectorFilter.owner("a\"b\\c")))
                .isEqualTo("owner == \"a\\\"b\\\\c\"");
    }

    @Test
    @DisplayName("Should report every call as an upstream failure without a client")
    void shouldFailWithoutClient() {
        MilvusCollectionManager manager = new MilvusCollectionManager(null, PROPS, new FixtureEmbeddingGateway());
        MilvusVectorStore store = new MilvusVectorStore(null, PROPS, manager);

        assertThatThrownBy(() -> store.query(FixtureEmbeddingGateway.axis(0), VectorFilter.none(), 5))
                .isInstanceOf(UpstreamException.class)
                .hasMessage("Vector store is not connected");
        assertThatThrownBy(store::stats).isInstanceOf(UpstreamException.class);
        assertThatCode(() -> store.upsert(List.of())).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should refuse to start when embedding and collection dimensions differ")
    void shouldRejectDimensionMismatch() {
        MilvusProperties mismatched = new MilvusProperties(
                false, "localhost", 19530, "", "agent_memories", 1536, 10_000, "STRONG");
        MilvusCollectionManager manager =
                new MilvusCollectionManager(null, mismatched, new FixtureEmbeddingGateway());

        assertThatThrownBy(manager::ensureCollection)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("(64)")
                .extracting(e -> ((ConfigurationException) e).getFault())
                .isEqualTo(ConfigurationException.Fault.DEPLOYER);
    }
}
