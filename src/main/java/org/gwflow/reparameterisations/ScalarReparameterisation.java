package org.gwflow.reparameterisations;

import org.gwflow.exceptions.GWFlowException.DomainException;
import org.gwflow.utils.Utils;
import org.gwflow.utils.mcmc.ParameterDescriptor;
import org.gwflow.utils.mcmc.Point;

import java.util.Collections;
import java.util.List;

/**
 * Base class for reparameterisations of a single physical parameter to a single transformed parameter.
 * Subclasses supply the scalar map, its inverse and the log-derivative of the forward map.
 */
public abstract class ScalarReparameterisation implements Reparameterisation {
    protected final ParameterDescriptor descriptor;
    private final String outputName;

    protected ScalarReparameterisation(final ParameterDescriptor descriptor, final String outputName) {
        this.descriptor = Utils.nonNull(descriptor, "The parameter descriptor cannot be null.");
        this.outputName = Utils.nonEmpty(outputName, "The output parameter name cannot be null or empty.");
    }

    /**
     * Output names default to the input name with a {@code _prime} suffix.
     */
    protected ScalarReparameterisation(final ParameterDescriptor descriptor) {
        this(descriptor, Utils.nonNull(descriptor).name() + "_prime");
    }

    /**
     * Maps a physical value to the transformed space.  Throws {@link DomainException} outside the domain.
     */
    protected abstract double transform(final double value);

    /**
     * Maps a transformed value back to physical space.  Throws {@link DomainException} if no valid physical value exists.
     */
    protected abstract double inverseTransform(final double transformedValue);

    /**
     * Log |d transform / d value| evaluated at the physical value.
     */
    protected abstract double logJacobian(final double value);

    public ParameterDescriptor getDescriptor() {
        return descriptor;
    }

    public String getName() {
        return descriptor.name();
    }

    public String getOutputName() {
        return outputName;
    }

    @Override
    public List<String> getInputParameters() {
        return Collections.singletonList(descriptor.name());
    }

    @Override
    public List<String> getOutputParameters() {
        return Collections.singletonList(outputName);
    }

    @Override
    public final TransformResult forward(final Point physical) {
        final double value = physical.get(descriptor.name());
        checkNotNaN(descriptor.name(), value);
        final double transformed = transform(value);
        final double logJacobian = checkLogJacobian(value, logJacobian(value));
        return new TransformResult(Point.builder().put(outputName, transformed).build(), logJacobian);
    }

    @Override
    public final TransformResult inverse(final Point transformed) {
        final double transformedValue = transformed.get(outputName);
        checkNotNaN(outputName, transformedValue);
        final double value = inverseTransform(transformedValue);
        final double logJacobian = checkLogJacobian(value, logJacobian(value));
        return new TransformResult(Point.builder().put(descriptor.name(), value).build(), -logJacobian);
    }

    /**
     * Throws {@link DomainException} unless {@code value} lies within the closed prior bounds.
     */
    protected final double checkWithinBounds(final double value) {
        if (value < descriptor.lower() || value > descriptor.upper()) {
            throw new DomainException(descriptor.name(), value,
                    "value is outside the prior bounds [" + descriptor.lower() + ", " + descriptor.upper() + "]");
        }
        return value;
    }

    private double checkLogJacobian(final double value, final double logJacobian) {
        if (!Double.isFinite(logJacobian)) {
            throw new DomainException(descriptor.name(), value, "log-Jacobian is not finite");
        }
        return logJacobian;
    }

    private static void checkNotNaN(final String name, final double value) {
        if (Double.isNaN(value)) {
            throw new DomainException(name, value, "value is NaN");
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + descriptor.name() + " -> " + outputName + ")";
    }
}
