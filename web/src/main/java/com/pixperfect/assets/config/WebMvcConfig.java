package com.pixperfect.assets.config;

import com.pixperfect.assets.service.LocalFileStorageService;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.lang.NonNull;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Serves the local storage directory under {@code /uploads/**} so the addresses
 * returned by {@link LocalFileStorageService} resolve without a token.
 */
@Configuration
@Profile("!s3 & !azure")
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

    private final LocalFileStorageService localFileStorageService;

    @Override
    public void addResourceHandlers(@NonNull ResourceHandlerRegistry registry) {
        registry.addResourceHandler(LocalFileStorageService.UPLOADS_PATH + "**")
                .addResourceLocations(localFileStorageService.getRootLocation().toUri().toString());
    }
}
