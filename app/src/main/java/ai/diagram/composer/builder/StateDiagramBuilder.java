package ai.diagram.composer.builder;

import ai.diagram.composer.branch.BranchAnalyzer;
import ai.diagram.composer.model.DiagramMetadata;
import ai.diagram.composer.model.Footer;
import ai.diagram.composer.model.Header;
import ai.diagram.composer.model.LayoutDirection;
import ai.diagram.composer.model.Legend;
import ai.diagram.composer.model.RegionSeparator;
import ai.diagram.composer.model.Scale;
import ai.diagram.composer.model.StateDiagram;
import ai.diagram.composer.model.StateDiagramStyle;
import ai.diagram.composer.registry.IdentityTokenGenerator;
import ai.diagram.composer.registry.SequentialTokenGenerator;
import java.util.Optional;

/**
 * Diagram-level scope: everything a {@link StateScope} offers plus diagram metadata and {@link #build()}.
 *
 * <pre>{@code
 * StateDiagramBuilder d = StateDiagramBuilder.create().title("Traffic light");
 * StateNode red = d.state("Red");
 * StateNode green = d.state("Green");
 * d.arrow(d.start(), red);
 * d.arrow(red, green, "timer");
 * String text = new StateDiagramRenderer().render(d.build());
 * }</pre>
 */
public final class StateDiagramBuilder extends StateScope {

    private String title;
    private String caption;
    private Header header;
    private Footer footer;
    private Legend legend;
    private Scale scale;
    private String theme;
    private LayoutDirection layout;
    private boolean hideEmptyDescription;
    private StateDiagramStyle style;

    private StateDiagramBuilder(BuildSession session) {
        super(session);
    }

    public static StateDiagramBuilder create() {
        return create(new SequentialTokenGenerator(), RegionSeparator.HORIZONTAL);
    }

    public static StateDiagramBuilder create(IdentityTokenGenerator tokenGenerator) {
        return create(tokenGenerator, RegionSeparator.HORIZONTAL);
    }

    public static StateDiagramBuilder create(IdentityTokenGenerator tokenGenerator, RegionSeparator defaultSeparator) {
        return new StateDiagramBuilder(new BuildSession(tokenGenerator, new BranchAnalyzer(), defaultSeparator));
    }

    public StateDiagramBuilder title(String value) {
        ensureUsable(ScopeOperation.SET_METADATA);
        this.title = value;
        return this;
    }

    public StateDiagramBuilder caption(String value) {
        ensureUsable(ScopeOperation.SET_METADATA);
        this.caption = value;
        return this;
    }

    public StateDiagramBuilder header(Header value) {
        ensureUsable(ScopeOperation.SET_METADATA);
        this.header = value;
        return this;
    }

    public StateDiagramBuilder footer(Footer value) {
        ensureUsable(ScopeOperation.SET_METADATA);
        this.footer = value;
        return this;
    }

    public StateDiagramBuilder legend(Legend value) {
        ensureUsable(ScopeOperation.SET_METADATA);
        this.legend = value;
        return this;
    }

    public StateDiagramBuilder scale(Scale value) {
        ensureUsable(ScopeOperation.SET_METADATA);
        this.scale = value;
        return this;
    }

    public StateDiagramBuilder theme(String value) {
        ensureUsable(ScopeOperation.SET_METADATA);
        this.theme = value;
        return this;
    }

    public StateDiagramBuilder layout(LayoutDirection value) {
        ensureUsable(ScopeOperation.SET_METADATA);
        this.layout = value;
        return this;
    }

    public StateDiagramBuilder hideEmptyDescription(boolean value) {
        ensureUsable(ScopeOperation.SET_METADATA);
        this.hideEmptyDescription = value;
        return this;
    }

    public StateDiagramBuilder style(StateDiagramStyle value) {
        ensureUsable(ScopeOperation.SET_METADATA);
        this.style = value;
        return this;
    }

    /**
     * Snapshot of everything declared so far. Fails while a nested scope is still open.
     */
    public StateDiagram build() {
        ensureUsable(ScopeOperation.BUILD);
        DiagramMetadata metadata = new DiagramMetadata(Optional.ofNullable(title), Optional.ofNullable(caption),
                Optional.ofNullable(header), Optional.ofNullable(footer), Optional.ofNullable(legend),
                Optional.ofNullable(scale), Optional.ofNullable(theme), Optional.ofNullable(layout),
                hideEmptyDescription, Optional.ofNullable(style));
        return new StateDiagram(elements(), metadata);
    }
}
