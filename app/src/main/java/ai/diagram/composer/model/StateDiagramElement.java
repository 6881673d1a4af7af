package ai.diagram.composer.model;

/**
 * Marker for every entry that can appear in the ordered element sequence of a diagram, a composite state or a region.
 */
public interface StateDiagramElement {
}
