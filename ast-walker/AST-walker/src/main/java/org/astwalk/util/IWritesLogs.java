package org.astwalk.util;

/** Marker interface for classes which emit debug output through a {@link Logger}. */
public interface IWritesLogs {}
