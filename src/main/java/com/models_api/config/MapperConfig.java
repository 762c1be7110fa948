package com.models_api.config;

import com.models_api.dto.task.TaskRecord;
import com.models_api.dto.task.TaskStatusDTO;
import org.modelmapper.ModelMapper;
import org.modelmapper.config.Configuration.AccessLevel;
import org.modelmapper.convention.MatchingStrategies;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MapperConfig {
    @Bean
    public ModelMapper modelMapper() {
        ModelMapper modelMapper = new ModelMapper();

        // startedAt/finishedAt must not be matched loosely against each other
        modelMapper.getConfiguration()
                .setMatchingStrategy(MatchingStrategies.STRICT)
                .setFieldMatchingEnabled(true)
                .setFieldAccessLevel(AccessLevel.PRIVATE)
                .setSkipNullEnabled(true);

        modelMapper.createTypeMap(TaskRecord.class, TaskStatusDTO.class);
        modelMapper.validate();

        return modelMapper;
    }
}
