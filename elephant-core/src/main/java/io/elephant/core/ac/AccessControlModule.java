package io.elephant.core.ac;

import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Scopes;
import io.elephant.spi.ac.PrincipalDirectory;

public class AccessControlModule
        implements Module
{
    @Override
    public void configure(Binder binder)
    {
        binder.bind(PrincipalDirectory.class).to(ConfigPrincipalDirectory.class).in(Scopes.SINGLETON);
    }
}
