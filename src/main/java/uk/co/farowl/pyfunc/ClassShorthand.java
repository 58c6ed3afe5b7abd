// Copyright (c)2024 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.pyfunc;

/** Some shorthands used to construct method signatures, etc.. */
interface ClassShorthand {

    static final Class<Object> O = Object.class;
    static final Class<?> V = void.class;
}
