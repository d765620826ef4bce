package com.questrail.courier.client.netty;

/**
 * Checks whether an optional runtime class can be loaded.
 */
@FunctionalInterface
interface RuntimeProbe
{
    boolean isAvailable(String className);

    RuntimeProbe CLASSPATH = className -> {
        try {
            Class.forName(className, false, RuntimeProbe.class.getClassLoader());
            return true;
        }
        catch (ClassNotFoundException | LinkageError e) {
            return false;
        }
    };
}
