package io.elephant.spi.ac;

public interface PrincipalDirectory
{
    /**
     * Returns true if a principal with the given name exists.
     */
    boolean exists(String principalName);

    /**
     * Returns true if caller is the principal itself or a direct or indirect member of it.
     *
     * @param caller name of the acting principal
     * @param principalName name of the principal that owns a job
     */
    boolean isMember(String caller, String principalName);
}
