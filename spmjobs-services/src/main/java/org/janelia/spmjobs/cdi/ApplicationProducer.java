package org.janelia.spmjobs.cdi;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.enterprise.inject.spi.InjectionPoint;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.janelia.spmjobs.cdi.qualifier.ApplicationProperties;
import org.janelia.spmjobs.cdi.qualifier.PropertyValue;
import org.janelia.spmjobs.config.ApplicationConfig;
import org.janelia.spmjobs.frames.NiftiVolumeReader;
import org.janelia.spmjobs.frames.VolumeReader;

@ApplicationScoped
public class ApplicationProducer {

    @ApplicationScoped
    @ApplicationProperties
    @Produces
    public ApplicationConfig applicationConfig() {
        return new ApplicationConfigProvider()
                .fromDefaultResources()
                .build();
    }

    @Produces
    public ObjectMapper objectMapper() {
        return ObjectMapperFactory.instance().getDefaultObjectMapper();
    }

    @Produces
    public VolumeReader volumeReader() {
        return new NiftiVolumeReader();
    }

    @PropertyValue(name = "")
    @Produces
    public String stringPropertyValue(@ApplicationProperties ApplicationConfig applicationConfig, InjectionPoint injectionPoint) {
        final PropertyValue property = injectionPoint.getAnnotated().getAnnotation(PropertyValue.class);
        return applicationConfig.getStringPropertyValue(property.name());
    }

}
