// Copyright (c)2024 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.pyfunc;

import java.util.Map;

/**
 * Python objects that have an instance dictionary, which the generic
 * attribute access of {@link PyBaseObject} will consult after the data
 * descriptors of the type.
 */
public interface WithDict {

    /**
     * The instance dictionary of this object. Implementations that
     * create the dictionary lazily may return {@code null} if
     * {@code create} is false and there is no dictionary yet.
     *
     * @param create if a dictionary should be created when absent
     * @return the instance dictionary or {@code null}
     */
    Map<Object, Object> getDict(boolean create);
}
