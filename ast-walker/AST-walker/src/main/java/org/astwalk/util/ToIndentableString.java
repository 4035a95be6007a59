package org.astwalk.util;

/** Interface implemented by objects that can be printed on an IIndentStream. */
public interface ToIndentableString {
    IIndentStream toString(IIndentStream builder);
}
