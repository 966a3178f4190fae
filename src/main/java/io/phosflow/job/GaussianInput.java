package io.phosflow.job;

import io.phosflow.config.PipelineSettings;
import io.phosflow.model.Geometry;
import io.phosflow.model.StepKind;
import io.phosflow.probe.Atom;

import java.util.List;

final class GaussianInput {
    private GaussianInput() {
    }

    /**
     * Route line for an optimisation or frequency job of the given state. S1 is a TD-DFT singlet
     * root; S0 and T1 are ground-state calculations of the given multiplicity.
     */
    static String route(Geometry geometry, StepKind kind, JobVariant variant, String methodRoute) {
        StringBuilder sb = new StringBuilder("#p ");
        if (geometry == Geometry.S1) {
            sb.append("td(singlet,nstate=10) ");
        }
        if (kind == StepKind.OPTIMIZATION) {
            sb.append(variant == JobVariant.STRICT_CONVERGENCE ? "opt=calcall" : "opt");
        } else {
            sb.append("freq");
        }
        return sb.append(' ').append(methodRoute).toString();
    }

    static String render(String jobName, String route, Geometry geometry, List<Atom> atoms, PipelineSettings settings) {
        StringBuilder sb = new StringBuilder();
        sb.append("%nprocshared=").append(settings.nproc()).append('\n');
        sb.append("%mem=").append(settings.memory()).append('\n');
        sb.append("%chk=").append(jobName).append(".chk").append('\n');
        sb.append(route).append('\n');
        sb.append('\n');
        sb.append(jobName).append('\n');
        sb.append('\n');
        sb.append(geometry.charge()).append(' ').append(geometry.multiplicity()).append('\n');
        for (Atom atom : atoms) {
            sb.append(atom.toXyzLine()).append('\n');
        }
        sb.append('\n');
        return sb.toString();
    }
}
