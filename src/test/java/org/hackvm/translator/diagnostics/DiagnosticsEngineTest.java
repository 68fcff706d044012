package org.hackvm.translator.diagnostics;

import org.hackvm.translator.api.SourceInfo;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class DiagnosticsEngineTest {

    private static final SourceInfo SOURCE = new SourceInfo("Main.vm", 4, "goto LOOP");

    @Test
    void startsEmpty() {
        DiagnosticsEngine engine = new DiagnosticsEngine();

        assertThat(engine.hasErrors()).isFalse();
        assertThat(engine.getDiagnostics()).isEmpty();
        assertThat(engine.summary()).isEmpty();
    }

    @Test
    void countsByType() {
        DiagnosticsEngine engine = new DiagnosticsEngine();

        engine.reportWarning("not translated", SOURCE);
        engine.reportWarning("not translated either", SOURCE);

        assertThat(engine.count(Diagnostic.Type.WARNING)).isEqualTo(2);
        assertThat(engine.hasErrors()).isFalse();

        engine.reportError("broken", SOURCE);
        assertThat(engine.hasErrors()).isTrue();
        assertThat(engine.count(Diagnostic.Type.ERROR)).isEqualTo(1);
    }

    @Test
    void summaryListsDiagnosticsInReportOrder() {
        DiagnosticsEngine engine = new DiagnosticsEngine();
        engine.reportWarning("first", SOURCE);
        engine.reportError("second", new SourceInfo("Main.vm", 9, "foo"));

        assertThat(engine.summary()).isEqualTo("[WARNING] Main.vm:4: first\n[ERROR] Main.vm:9: second");
    }

    @Test
    void diagnosticsAreReadOnly() {
        DiagnosticsEngine engine = new DiagnosticsEngine();
        engine.reportWarning("x", SOURCE);

        assertThatThrownBy(() -> engine.getDiagnostics().clear()).isInstanceOf(UnsupportedOperationException.class);
        assertThat(engine.getDiagnostics().get(0))
                .isEqualTo(new Diagnostic(Diagnostic.Type.WARNING, "x", "Main.vm", 4));
    }
}
