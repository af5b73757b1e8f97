package io.github.citesync.refs;

import com.vladsch.flexmark.util.data.DataKey;
import io.github.citesync.refs.label.LabelGenerator;
import io.github.citesync.refs.label.NumberedLabelGenerator;

import javax.swing.*;
import java.util.concurrent.Executor;

/**
 * Option keys for {@link ReferenceManager}, set on a {@link com.vladsch.flexmark.util.data.MutableDataSet}.
 */
public final class ReferenceOptions {
    private static final Executor EVENT_DISPATCH_THREAD = SwingUtilities::invokeLater;

    /**
     * Label generator for bibliography references.
     */
    public static final DataKey<LabelGenerator> LABEL_GENERATOR =
            new DataKey<>("LABEL_GENERATOR", new NumberedLabelGenerator());

    /**
     * Value of the xref {@code ref-type} attribute that marks a bibliography citation.
     */
    public static final DataKey<String> CITATION_REF_TYPE = new DataKey<>("CITATION_REF_TYPE", "bibr");

    /**
     * Where deferred label updates run. Defaults to the Swing event dispatch thread, i.e. after the
     * event currently being handled. With the default, the host must also edit the document on that
     * thread, since label updates read the document without locking.
     */
    public static final DataKey<Executor> SCHEDULER = new DataKey<>("SCHEDULER", EVENT_DISPATCH_THREAD);

    private ReferenceOptions() {
    }
}
