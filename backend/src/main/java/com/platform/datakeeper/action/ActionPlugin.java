package com.platform.datakeeper.action;

import com.platform.datakeeper.data.DataUnit;
import com.platform.datakeeper.error.ActionExecutionException;
import com.platform.datakeeper.policy.ActionSpec;

import java.io.IOException;

/**
 * An action kind. Implementations are Spring beans or, for third-party plugins,
 * {@link java.util.ServiceLoader} providers in a jar under the plugin directory.
 * 
 * Plugins never touch jobs; they report through the returned {@link Outcome} or by throwing.
 */
public interface ActionPlugin {
    
    /**
     * Name the registry resolves, matching {@link ActionSpec#kind()}.
     */
    String kind();
    
    /**
     * Applies {@code spec} to {@code unit}.
     *
     * @throws ActionExecutionException for malformed data or violated constraints
     * @throws IOException when the data store fails
     */
    Outcome execute(DataUnit unit, ActionSpec spec, ActionContext context) throws IOException;
}
