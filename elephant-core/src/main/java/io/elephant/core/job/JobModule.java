package io.elephant.core.job;

import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Scopes;

public class JobModule
        implements Module
{
    @Override
    public void configure(Binder binder)
    {
        binder.bind(JobLifecycleValidator.class).in(Scopes.SINGLETON);
        binder.bind(JobAdmissionController.class).in(Scopes.SINGLETON);
        binder.bind(JobManager.class).in(Scopes.SINGLETON);
    }
}
