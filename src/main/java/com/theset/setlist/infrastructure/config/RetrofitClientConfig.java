package com.theset.setlist.infrastructure.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.theset.setlist.infrastructure.adapter.catalog.CatalogApi;
import com.theset.setlist.infrastructure.adapter.ticketing.TicketingApi;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import retrofit2.Retrofit;
import retrofit2.converter.jackson.JacksonConverterFactory;

@Configuration
public class RetrofitClientConfig {

    @Bean
    public CatalogApi catalogApi(CatalogApiConfig config) {
        OkHttpClient.Builder httpClient = new OkHttpClient.Builder();
        String apiKey = config.getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            httpClient.addInterceptor(chain -> chain.proceed(chain.request().newBuilder()
                    .header("Authorization", "Bearer " + apiKey)
                    .build()));
        }

        Retrofit retrofit = new Retrofit.Builder()
                .baseUrl(config.getBaseUrl())
                .client(httpClient.build())
                .addConverterFactory(JacksonConverterFactory.create(jsonMapper()))
                .build();

        return retrofit.create(CatalogApi.class);
    }

    @Bean
    public TicketingApi ticketingApi(TicketingApiConfig config) {
        Retrofit retrofit = new Retrofit.Builder()
                .baseUrl(config.getBaseUrl())
                .addConverterFactory(JacksonConverterFactory.create(jsonMapper()))
                .build();

        return retrofit.create(TicketingApi.class);
    }

    static ObjectMapper jsonMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }
}
