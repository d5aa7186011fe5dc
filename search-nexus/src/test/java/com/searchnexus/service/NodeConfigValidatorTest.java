package com.searchnexus.service;

import com.searchnexus.config.NexusProperties;
import com.searchnexus.exception.ResourceExhaustionException;
import com.searchnexus.model.ConflictType;
import com.searchnexus.model.NodeConfig;
import com.searchnexus.model.NodeRoles;
import com.searchnexus.model.ValidationMode;
import com.searchnexus.model.ValidationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.searchnexus.service.NexusTestContext.GIGABYTE;
import static com.searchnexus.service.NexusTestContext.node;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class NodeConfigValidatorTest {

    private NexusProperties properties;
    private NodeConfigValidator validator;
    private List<NodeConfig> registered;

    @BeforeEach
    void setUp() {
        properties = new NexusProperties();
        validator = new NodeConfigValidator(mock(NodeRegistry.class), () -> 8 * GIGABYTE, properties);
        registered = List.of(node("node-1", 9200, 9300), node("node-2", 9201, 9301));
    }

    private ValidationResult create(NodeConfig candidate) {
        return validator.validate(candidate, ValidationMode.CREATE, null, registered);
    }

    @Test
    void acceptsDisjointCandidateRepeatedly() {
        NodeConfig candidate = node("node-3", 9202, 9302);

        ValidationResult first = create(candidate);
        ValidationResult second = create(candidate);

        assertThat(first.isValid()).isTrue();
        assertThat(first.getConflicts()).isEmpty();
        assertThat(second).isEqualTo(first);
    }

    @Test
    void suggestsFirstFreeHttpPortAboveRequested() {
        ValidationResult result = create(node("node-3", 9200, 9302));

        assertThat(result.isValid()).isFalse();
        assertThat(result.hasConflict(ConflictType.HTTP_PORT)).isTrue();
        assertThat(result.getSuggestions().getHttpPort()).isEqualTo(9202);
        assertThat(result.getSuggestions().getTransportPort()).isEqualTo(9302);
        assertThat(result.getSuggestions().getNodeName()).isNull();
    }

    @Test
    void comparesPortsAcrossBothFields() {
        ValidationResult result = create(node("node-3", 9300, 9201));

        assertThat(result.getConflicts())
                .extracting(c -> c.getType())
                .containsExactlyInAnyOrder(ConflictType.HTTP_PORT, ConflictType.TRANSPORT_PORT);
        assertThat(result.getConflicts()).extracting(c -> c.getConflictWith())
                .containsExactlyInAnyOrder("node-1", "node-2");
    }

    @Test
    void transportSuggestionNeverEqualsHttpSuggestion() {
        ValidationResult result = create(node("node-3", 9200, 9200));

        assertThat(result.getSuggestions().getHttpPort()).isEqualTo(9202);
        assertThat(result.getSuggestions().getTransportPort()).isNotEqualTo(9202);
    }

    @Test
    void rejectsEqualHttpAndTransportPort() {
        ValidationResult result = create(node("node-3", 9500, 9500));

        assertThat(result.hasConflict(ConflictType.TRANSPORT_PORT)).isTrue();
        assertThat(result.getSuggestions().getHttpPort()).isEqualTo(9500);
        assertThat(result.getSuggestions().getTransportPort()).isEqualTo(9501);
    }

    @Test
    void nameConflictYieldsNameSuggestionsOnly() {
        List<NodeConfig> withSuffix = List.of(node("node-1", 9200, 9300), node("node-1-2", 9201, 9301));

        NodeConfig candidate = node("node-1", 9400, 9500);
        candidate.setDataPath("/data/elsewhere");
        candidate.setLogsPath("/logs/elsewhere");

        ValidationResult result = validator.validate(candidate, ValidationMode.CREATE, null, withSuffix);

        assertThat(result.getConflicts()).extracting(c -> c.getType()).containsExactly(ConflictType.NODE_NAME);
        assertThat(result.getSuggestions().getNodeName()).containsExactly("node-1-3", "node-1-4", "node-1-5");
        assertThat(result.getSuggestions().getHttpPort()).isNull();
    }

    @Test
    void nameComparisonIsCaseSensitive() {
        assertThat(create(node("NODE-1", 9400, 9500)).isValid()).isTrue();
    }

    @Test
    void rejectsHeapAboveThreeQuartersOfMemory() {
        NodeConfig big = node("node-3", 9202, 9302);
        big.setHeapSize("10g");
        NodeConfig fits = node("node-3", 9202, 9302);
        fits.setHeapSize("4g");
        NodeConfig edge = node("node-3", 9202, 9302);
        edge.setHeapSize("6144M");

        assertThat(create(big).hasConflict(ConflictType.HEAP_SIZE)).isTrue();
        assertThat(create(fits).isValid()).isTrue();
        assertThat(create(edge).isValid()).isTrue();
    }

    @Test
    void rejectsMalformedHeap() {
        NodeConfig candidate = node("node-3", 9202, 9302);
        candidate.setHeapSize("4 gb");

        ValidationResult result = create(candidate);

        assertThat(result.getConflicts()).extracting(c -> c.getType()).containsExactly(ConflictType.HEAP_SIZE);
        assertThat(result.getSuggestions().isEmpty()).isTrue();
    }

    @Test
    void detectsSharedPathsAfterNormalization() {
        NodeConfig candidate = node("node-3", 9202, 9302);
        candidate.setDataPath("/srv/nodes/node-1/./data");
        candidate.setLogsPath("/srv/nodes/node-2/config/../logs");

        ValidationResult result = create(candidate);

        assertThat(result.getConflicts()).extracting(c -> c.getType())
                .containsExactlyInAnyOrder(ConflictType.DATA_PATH, ConflictType.LOGS_PATH);
    }

    @Test
    void updateExcludesTheNodeBeingReplaced() {
        NodeConfig unchanged = node("node-1", 9200, 9300);
        NodeConfig renamed = node("node-1b", 9200, 9300);
        renamed.setDataPath(unchanged.getDataPath());

        assertThat(validator.validate(unchanged, ValidationMode.UPDATE, "node-1", registered).isValid()).isTrue();
        assertThat(validator.validate(renamed, ValidationMode.UPDATE, "node-1", registered).isValid()).isTrue();
        assertThat(validator.validate(node("node-1", 9201, 9300), ValidationMode.UPDATE, "node-1", registered)
                .hasConflict(ConflictType.HTTP_PORT)).isTrue();
    }

    @Test
    void emptyRolesFollowConfiguredPolicy() {
        NodeConfig candidate = node("node-3", 9202, 9302);
        candidate.setRoles(new NodeRoles(false, false, false));

        ValidationResult warned = create(candidate);
        assertThat(warned.isValid()).isTrue();
        assertThat(warned.getWarnings()).hasSize(1);

        properties.getValidation().setEmptyRolesPolicy(NexusProperties.EmptyRolesPolicy.REJECT);
        assertThat(create(candidate).hasConflict(ConflictType.NODE_ROLES)).isTrue();

        properties.getValidation().setEmptyRolesPolicy(NexusProperties.EmptyRolesPolicy.ALLOW);
        ValidationResult allowed = create(candidate);
        assertThat(allowed.isValid()).isTrue();
        assertThat(allowed.getWarnings()).isEmpty();
    }

    @Test
    void portSearchIsBounded() {
        properties.getValidation().setPortSearchWindow(2);
        List<NodeConfig> crowded = List.of(node("a", 9200, 9201), node("b", 9202, 9300));

        assertThatThrownBy(() -> validator.validate(node("c", 9200, 9400), ValidationMode.CREATE, null, crowded))
                .isInstanceOf(ResourceExhaustionException.class);
    }
}
