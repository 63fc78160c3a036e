package dev.leaddispatch.repository;

import dev.leaddispatch.entity.Message;
import dev.leaddispatch.model.MessageChannel;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface MessageRepository extends JpaRepository<Message, Long> {

    interface ChannelCount {
        MessageChannel getChannel();

        Long getTotal();
    }

    List<Message> findByLeadIdOrderByIdAsc(Long leadId);

    @Query("SELECT m.channel AS channel, COUNT(m) AS total FROM Message m GROUP BY m.channel")
    List<ChannelCount> countByChannelGrouped();
}
