package org.astwalk.util;

import com.fasterxml.jackson.databind.node.ObjectNode;

/** Interface implemented by objects that can be serialized as JSON. */
public interface IJson {
    /** Serialize this object as a JSON object.
     * The object always carries a 'class' property naming the Java class. */
    ObjectNode asJson();
}
